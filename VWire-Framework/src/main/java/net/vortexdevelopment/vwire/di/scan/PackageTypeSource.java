package net.vortexdevelopment.vwire.di.scan;

import lombok.Getter;
import org.jetbrains.annotations.NotNull;
import org.reflections.Configuration;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ConfigurationBuilder;

import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Scans the classpath for every class under a package.
 * Results are ordered by class name so repeated scans register the same classes.
 */
public class PackageTypeSource implements TypeSource {

    @Getter
    private final String packageName;
    private final String[] ignoredPackages;

    public PackageTypeSource(@NotNull String packageName, String... ignoredPackages) {
        this.packageName = packageName;
        this.ignoredPackages = ignoredPackages;
    }

    public static PackageTypeSource forPackageOf(@NotNull Class<?> anchor, String... ignoredPackages) {
        return new PackageTypeSource(anchor.getPackageName(), ignoredPackages);
    }

    /**
     * Reflections configuration limited to the package path, minus ignored packages.
     */
    Configuration createConfiguration() {
        String packagePath = packageName.replace('.', '/');
        List<String> ignoredPaths = Arrays.stream(ignoredPackages)
                .map(ignored -> ignored.replace('.', '/') + "/")
                .collect(Collectors.toList());

        return new ConfigurationBuilder()
                .forPackage(packageName)
                .setScanners(Scanners.SubTypes.filterResultsBy(s -> true))
                .filterInputsBy(s -> {
                    if (s == null) return false;
                    if (s.startsWith("META-INF")) return false;
                    if (!s.endsWith(".class")) return false;

                    // Only include classes under the package path
                    if (!s.startsWith(packagePath + "/")) {
                        return false;
                    }

                    for (String ignoredPath : ignoredPaths) {
                        if (s.startsWith(ignoredPath)) {
                            return false;
                        }
                    }
                    return true;
                });
    }

    @Override
    @NotNull
    public Collection<Class<?>> getTypes() {
        Reflections reflections = new Reflections(createConfiguration());
        return reflections.getSubTypesOf(Object.class).stream()
                .filter(type -> type.getName().startsWith(packageName + "."))
                .sorted(Comparator.comparing(Class::getName))
                .collect(Collectors.toList());
    }
}

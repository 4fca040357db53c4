package net.vortexdevelopment.vwire.di.engine;

import lombok.Getter;
import net.vortexdevelopment.vwire.exception.PropertyInjectionException;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Member;
import java.lang.reflect.Method;
import java.lang.reflect.Type;

/**
 * A field or setter that receives a resolved dependency after construction.
 */
@Getter
public final class InjectionPoint {

    private final Member member;
    private final Type targetType;

    private InjectionPoint(Member member, Type targetType) {
        this.member = member;
        this.targetType = targetType;
    }

    static InjectionPoint forField(Field field, Type targetType) {
        return new InjectionPoint(field, targetType);
    }

    static InjectionPoint forSetter(Method method, Type targetType) {
        return new InjectionPoint(method, targetType);
    }

    public boolean isField() {
        return member instanceof Field;
    }

    public String getDescription() {
        return (isField() ? "field " : "setter ") + member.getDeclaringClass().getSimpleName() + "." + member.getName();
    }

    /**
     * Assign the value to the field or pass it to the setter.
     *
     * @throws PropertyInjectionException if reflection fails or the setter throws
     */
    public void inject(@NotNull Object instance, Object value) {
        try {
            if (member instanceof Field field) {
                field.setAccessible(true);
                field.set(instance, value);
            } else {
                Method method = (Method) member;
                method.setAccessible(true);
                method.invoke(instance, value);
            }
        } catch (InvocationTargetException e) {
            throw new PropertyInjectionException(targetType, "Error invoking @Inject " + getDescription()
                    + " on " + instance.getClass().getName(), e.getTargetException());
        } catch (ReflectiveOperationException | IllegalArgumentException e) {
            throw new PropertyInjectionException(targetType, "Unable to inject " + getDescription()
                    + " on " + instance.getClass().getName(), e);
        }
    }
}

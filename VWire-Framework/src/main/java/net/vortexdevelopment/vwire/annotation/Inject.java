package net.vortexdevelopment.vwire.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a field or setter that the container populates after construction.
 *
 * <p>Supported targets:
 * <ul>
 *   <li>FIELD - any non-static, non-final field, including private and inherited ones</li>
 *   <li>METHOD - single-argument instance methods; an override of an annotated method stays injectable</li>
 * </ul>
 *
 * <p>Examples:
 * <pre>
 * // Field injection
 * {@literal @}Inject
 * private AuditLog auditLog;
 *
 * // Setter injection
 * {@literal @}Inject
 * public void setClock(Clock clock) {
 *     this.clock = clock;
 * }
 * </pre>
 *
 * Constructor parameters never need this annotation, they are always resolved.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.METHOD})
public @interface Inject {
}

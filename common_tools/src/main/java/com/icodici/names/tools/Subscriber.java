package com.icodici.names.tools;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation for methods to receive events with the {@link Informer}.
 * <p>
 * Decorate any public method with one argument of some public class, then register the owning object with the
 * informer to receive events that can be cast to the type of the argument. If the method returns boolean, returning
 * true stops further delivery of this event.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Subscriber {
}

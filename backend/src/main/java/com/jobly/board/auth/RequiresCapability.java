package com.jobly.board.auth;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the capability a handler method needs. Handlers without the annotation are
 * {@link Capability#PUBLIC}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface RequiresCapability {

    Capability value();

    /** Path variable holding the subject id, used by {@link Capability#ADMIN_OR_SELF}. */
    String subjectParam() default "username";
}

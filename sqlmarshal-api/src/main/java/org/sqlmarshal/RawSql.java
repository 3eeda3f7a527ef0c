package org.sqlmarshal;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// Marks the `String` parameter whose runtime value is the command text to execute.
///
/// The parameter is never bound as a value. The text may reference the other parameters
/// as `@snake_case_name`.
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.PARAMETER)
public @interface RawSql {}

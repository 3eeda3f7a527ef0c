/// Declarative markers and the JDBC command runtime called by code generated for
/// [org.sqlmarshal.SqlMarshal] methods.
@NullMarked
package org.sqlmarshal;

import org.jspecify.annotations.NullMarked;

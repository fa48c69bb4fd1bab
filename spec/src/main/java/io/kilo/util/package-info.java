@NullMarked
package io.kilo.util;

import org.jspecify.annotations.NullMarked;

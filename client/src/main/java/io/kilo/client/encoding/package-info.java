@NullMarked
package io.kilo.client.encoding;

import org.jspecify.annotations.NullMarked;

@NullMarked
package io.kilo.client.dispatch;

import org.jspecify.annotations.NullMarked;

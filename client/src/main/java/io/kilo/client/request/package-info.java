@NullMarked
package io.kilo.client.request;

import org.jspecify.annotations.NullMarked;

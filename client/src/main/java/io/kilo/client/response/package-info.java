/**
 * Response classification and decoding.
 */
@NullMarked
package io.kilo.client.response;

import org.jspecify.annotations.NullMarked;

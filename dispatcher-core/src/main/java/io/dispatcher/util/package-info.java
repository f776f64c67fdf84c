/**
 * Default implementations of the extension points.
 */
package io.dispatcher.util;

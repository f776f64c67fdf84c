/**
 * Extension points: identifier generation and metrics export.
 */
package io.dispatcher.spi;

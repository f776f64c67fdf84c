/**
 * The dispatcher, its bulk subscription input, and dispatch interceptors.
 */
package io.dispatcher.dispatch;

/**
 * Runnable walkthrough of the dispatcher API.
 */
package io.dispatcher.demo;

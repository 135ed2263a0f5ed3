/**
 * HTTP boundary: conversation routes, ping, and exception-to-response mapping.
 */
package com.phillippitts.poseidon.presentation;

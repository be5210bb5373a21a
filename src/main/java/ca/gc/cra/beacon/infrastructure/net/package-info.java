/**
 * TCP connectivity to the console: handshake, framed sends with acknowledgements, and WSL host detection.
 */
package ca.gc.cra.beacon.infrastructure.net;

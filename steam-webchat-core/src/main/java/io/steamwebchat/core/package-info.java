/**
 * Protocol-centric core for the Steam web chat client.
 *
 * <p>This module is deliberately framework-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants and small enums (operations, message types, persona states)</li>
 *   <li>Form encoding for request parameters</li>
 *   <li>The error hierarchy shared by decoders and callers</li>
 * </ul>
 *
 * <p>HTTP and JSON bindings live in other modules.
 */
package io.steamwebchat.core;

/**
 * JSON decode primitive used by the response decoders.
 *
 * <p>Bindings to concrete JSON libraries live in separate modules and register themselves with
 * {@link java.util.ServiceLoader} as {@link io.steamwebchat.json.spi.JsonCodec} providers.
 */
package io.steamwebchat.json.spi;

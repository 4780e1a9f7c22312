/**
 * Jackson binding of the {@link io.streamingmarkdown.core.EventCodec} SPI.
 */
package io.streamingmarkdown.json.jackson;

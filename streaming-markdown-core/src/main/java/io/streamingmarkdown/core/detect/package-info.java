/**
 * Block classification.
 *
 * <p>{@link io.streamingmarkdown.core.detect.BlockTypeDetector} evaluates an ordered table of
 * {@link io.streamingmarkdown.core.detect.BlockMatcher}s against the text at a line start and answers
 * with a {@link io.streamingmarkdown.core.detect.Detection}. Matchers are pure: they never consume
 * input, and they answer {@link io.streamingmarkdown.core.detect.Detection.NeedMoreInput} while the
 * text could still grow into a longer marker.
 */
package io.streamingmarkdown.core.detect;

package io.twingraph.events.capture.pgoutput;

/**
 * Outcome of decoding one replication payload.
 */
public interface DecodeResult {

    record Decoded(PgOutputMessage message) implements DecodeResult {
    }

    record Skipped(char tag, String reason) implements DecodeResult {
    }
}

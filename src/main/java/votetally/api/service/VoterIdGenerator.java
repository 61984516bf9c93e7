package votetally.api.service;

import org.springframework.stereotype.Component;

import java.util.HexFormat;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Issues voter ids as 16 lowercase hex characters (64 random bits). Ids only
 * need to be unique, not secret.
 */
@Component
public class VoterIdGenerator {

    private static final HexFormat HEX = HexFormat.of();

    public String next() {
        return HEX.toHexDigits(ThreadLocalRandom.current().nextLong());
    }
}

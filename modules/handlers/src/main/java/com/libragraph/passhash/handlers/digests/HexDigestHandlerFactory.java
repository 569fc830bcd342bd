package com.libragraph.passhash.handlers.digests;

import com.libragraph.passhash.handlers.api.HandlerFactory;
import com.libragraph.passhash.handlers.api.PasswordHandler;
import com.libragraph.passhash.handlers.digest.PlainDigest;
import com.libragraph.passhash.handlers.normalize.SettingNormalizer;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Arrays;
import java.util.List;

/**
 * Plain unsalted digests, kept for reading hashes from legacy user tables.
 */
@ApplicationScoped
public class HexDigestHandlerFactory implements HandlerFactory {

    @Override
    public List<PasswordHandler> createHandlers() {
        SettingNormalizer normalizer = SettingNormalizer.secure();
        return Arrays.stream(PlainDigest.values())
                .<PasswordHandler>map(digest -> new HexDigestHandler(digest, normalizer))
                .toList();
    }
}

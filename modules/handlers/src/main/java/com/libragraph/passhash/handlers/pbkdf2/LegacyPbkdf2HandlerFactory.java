package com.libragraph.passhash.handlers.pbkdf2;

import com.libragraph.passhash.handlers.api.HandlerFactory;
import com.libragraph.passhash.handlers.api.PasswordHandler;
import com.libragraph.passhash.handlers.normalize.SettingNormalizer;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;

/**
 * PBKDF2 formats written by other applications: Cryptacular, dlitz' pbkdf2 module,
 * Atlassian products and GRUB2.
 */
@ApplicationScoped
public class LegacyPbkdf2HandlerFactory implements HandlerFactory {

    @Override
    public List<PasswordHandler> createHandlers() {
        SettingNormalizer normalizer = SettingNormalizer.secure();
        return List.of(
                new Pbkdf2Handler(Pbkdf2Variant.cryptacular(), normalizer),
                new Pbkdf2Handler(Pbkdf2Variant.dlitz(), normalizer),
                new AtlassianPbkdf2Handler(normalizer),
                new Pbkdf2Handler(Pbkdf2Variant.grub(), normalizer)
        );
    }
}

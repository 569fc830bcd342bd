package com.libragraph.passhash.handlers.pbkdf2;

import com.libragraph.passhash.handlers.api.HandlerFactory;
import com.libragraph.passhash.handlers.api.PasswordHandler;
import com.libragraph.passhash.handlers.digest.Pbkdf2Digest;
import com.libragraph.passhash.handlers.normalize.SettingNormalizer;
import com.libragraph.passhash.handlers.wrap.PrefixWrapperHandler;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Modular-crypt PBKDF2 handlers for SHA-1, SHA-256 and SHA-512, plus their
 * LDAP {@code {PBKDF2-*}} spellings.
 */
@ApplicationScoped
public class Pbkdf2HandlerFactory implements HandlerFactory {

    @Override
    public List<PasswordHandler> createHandlers() {
        SettingNormalizer normalizer = SettingNormalizer.secure();
        List<PasswordHandler> handlers = new ArrayList<>();
        for (Pbkdf2Digest digest : Pbkdf2Digest.values()) {
            Pbkdf2Handler handler = new Pbkdf2Handler(Pbkdf2Variant.modular(digest), normalizer);
            handlers.add(handler);
            handlers.add(ldapWrapper(handler, digest));
        }
        return handlers;
    }

    private static PasswordHandler ldapWrapper(Pbkdf2Handler handler, Pbkdf2Digest digest) {
        String prefix = digest == Pbkdf2Digest.SHA1
                ? "{PBKDF2}"
                : "{PBKDF2-" + digest.label().toUpperCase(Locale.ROOT) + "}";
        return new PrefixWrapperHandler("ldap_" + handler.name(), handler, handler.spec().primaryIdent(), prefix);
    }
}

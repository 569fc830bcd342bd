package com.libragraph.passhash.handlers.crypt;

import com.libragraph.passhash.handlers.api.HandlerFactory;
import com.libragraph.passhash.handlers.api.PasswordHandler;
import com.libragraph.passhash.handlers.normalize.SettingNormalizer;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;

@ApplicationScoped
public class ShaCryptHandlerFactory implements HandlerFactory {

    @Override
    public List<PasswordHandler> createHandlers() {
        return List.of(new Sha512CryptHandler(SettingNormalizer.secure()));
    }
}

package com.questrail.fleet.credentials;

import com.questrail.fleet.api.FleetLinkException;

/**
 * Stored or supplied configuration cannot be used.
 *
 * <p>Raised when persisted credentials are corrupted or were encrypted with a
 * different key, and when a settings file is invalid. The caller is expected
 * to ask the operator for a fresh configuration; a partially decrypted config
 * is never returned.</p>
 */
public final class ConfigException extends FleetLinkException
{
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}

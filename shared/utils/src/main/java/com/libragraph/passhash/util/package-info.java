/**
 * Shared utilities for all passhash modules.
 *
 * <p>Contains the text codecs used by hash formats ({@link com.libragraph.passhash.util.Hash64Codec},
 * {@link com.libragraph.passhash.util.AltBase64}) and the {@link com.libragraph.passhash.util.Checksum}
 * value type. No framework dependencies.
 */
package com.libragraph.passhash.util;

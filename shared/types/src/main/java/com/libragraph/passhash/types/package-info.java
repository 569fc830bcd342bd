/**
 * Pure Java value types shared across all passhash modules.
 *
 * <p>Handler capability vocabulary: {@link com.libragraph.passhash.types.CostFunction}
 * and {@link com.libragraph.passhash.types.SettingKeyword}.
 * This module has no framework dependencies.
 */
package com.libragraph.passhash.types;

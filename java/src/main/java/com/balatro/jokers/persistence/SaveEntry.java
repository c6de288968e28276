package com.balatro.jokers.persistence;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One persisted joker instance.
 *
 * @param position       Index in the saved run order
 * @param id             Wire name as written; may name a kind this build no longer knows
 * @param slot           Instance slot, unique within a save
 * @param schemaVersion  Version of the instance's state payload
 * @param sellValueBonus Sell value accrued on top of the base value
 * @param state          The instance's own payload, or null for stateless kinds
 */
public record SaveEntry(int position, String id, int slot, int schemaVersion, int sellValueBonus, JsonNode state) {
}

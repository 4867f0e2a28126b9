package org.royalewatch.service;

import org.json.JSONObject;

import java.util.List;

/**
 * Raw player lookups backing {@code /search} and the status board.
 */
public interface PlayerDirectory {

    JSONObject fetchPlayer(String tag) throws ApiException;

    JSONObject fetchClan(String clanTag) throws ApiException;

    /** The {@code items} of the upcoming chest cycle, next chest first. */
    List<JSONObject> fetchUpcomingChests(String tag) throws ApiException;
}

package org.royalewatch.service;

import org.json.JSONObject;
import org.royalewatch.model.PlayerProfile;

import java.util.List;

/**
 * Read access to the external player API. Tags are passed normalized (no '#').
 */
public interface BattleLogSource {

    PlayerProfile fetchProfile(String tag) throws ApiException;

    /** Raw battle entries, newest first. */
    List<JSONObject> fetchBattleLog(String tag) throws ApiException;
}

package com.supalosa.hive;

import com.supalosa.hive.agent.ParasiteAgent;

/**
 * Notified of parasite lifecycle events, for example to report them over the network.
 */
public interface ParasiteEventListener {

    default void onParasiteSpawned(ParasiteAgent agent) {
    }

    void onParasiteDestroyed(ParasiteAgent agent);
}

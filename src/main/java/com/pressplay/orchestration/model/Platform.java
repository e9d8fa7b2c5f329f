package com.pressplay.orchestration.model;

/** Game distribution platforms reported by the backend's discovery. */
public enum Platform {
    STEAM("Steam"),
    EPIC_GAMES("Epic Games"),
    GOG_GALAXY("GOG Galaxy"),
    UBISOFT_CONNECT("Ubisoft Connect"),
    EA_APP("EA App"),
    BATTLE_NET("Battle.net"),
    XBOX_GAME_PASS("Xbox Game Pass"),
    CUSTOM("Custom");

    private final String displayName;

    Platform(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}

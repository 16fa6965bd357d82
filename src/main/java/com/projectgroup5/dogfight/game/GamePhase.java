package com.projectgroup5.dogfight.game;

/**
 * 对局阶段：LOBBY → COUNTDOWN → PLAYING → RESULTS → LOBBY
 */
public enum GamePhase {
    LOBBY,      // 等待玩家进入
    COUNTDOWN,  // 倒计时
    PLAYING,    // 对战中
    RESULTS     // 结算展示
}

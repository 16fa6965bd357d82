package com.projectgroup5.dogfight.client;

/**
 * 本地飞船的预测状态
 */
public enum PredictionState {
    /** 有尚未被服务器确认的本地输入 */
    PREDICTED,
    /** 误差超过阈值，正在把渲染位置平滑过渡到校正后的位置 */
    RECONCILING,
    /** 最近一次权威状态与预测一致 */
    SYNCED
}

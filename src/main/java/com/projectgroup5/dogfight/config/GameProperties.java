package com.projectgroup5.dogfight.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 服务器可调参数（application.yml 中的 dogfight.*）
 * 所有字段都有默认值，测试里直接 new 即可使用
 */
@ConfigurationProperties(prefix = "dogfight")
public class GameProperties {

    private final Simulation simulation = new Simulation();
    private final Movement movement = new Movement();
    private final Combat combat = new Combat();
    private final Shield shield = new Shield();
    private final Collectibles collectibles = new Collectibles();
    private final Phase phase = new Phase();
    private final Network network = new Network();
    private final Reconciliation reconciliation = new Reconciliation();
    private final Admin admin = new Admin();

    public Simulation getSimulation() {
        return simulation;
    }

    public Movement getMovement() {
        return movement;
    }

    public Combat getCombat() {
        return combat;
    }

    public Shield getShield() {
        return shield;
    }

    public Collectibles getCollectibles() {
        return collectibles;
    }

    public Phase getPhase() {
        return phase;
    }

    public Network getNetwork() {
        return network;
    }

    public Reconciliation getReconciliation() {
        return reconciliation;
    }

    public Admin getAdmin() {
        return admin;
    }

    /** 固定步长模拟 */
    public static class Simulation {
        private long tickMillis = 50;
        // 调度器检查各房间时钟的间隔
        private long pollIntervalMillis = 10;
        private int maxCatchUpSteps = 5;
        private int maxConsecutiveFaults = 5;
        private long emptyRoomGraceMillis = 30_000L;
        private int snapshotHistory = 64;
        private String levelName = "default";

        public long getTickMillis() {
            return tickMillis;
        }

        public void setTickMillis(long tickMillis) {
            this.tickMillis = tickMillis;
        }

        public long getPollIntervalMillis() {
            return pollIntervalMillis;
        }

        public void setPollIntervalMillis(long pollIntervalMillis) {
            this.pollIntervalMillis = pollIntervalMillis;
        }

        public double getTickSeconds() {
            return tickMillis / 1000.0;
        }

        public int getMaxCatchUpSteps() {
            return maxCatchUpSteps;
        }

        public void setMaxCatchUpSteps(int maxCatchUpSteps) {
            this.maxCatchUpSteps = maxCatchUpSteps;
        }

        public int getMaxConsecutiveFaults() {
            return maxConsecutiveFaults;
        }

        public void setMaxConsecutiveFaults(int maxConsecutiveFaults) {
            this.maxConsecutiveFaults = maxConsecutiveFaults;
        }

        public long getEmptyRoomGraceMillis() {
            return emptyRoomGraceMillis;
        }

        public void setEmptyRoomGraceMillis(long emptyRoomGraceMillis) {
            this.emptyRoomGraceMillis = emptyRoomGraceMillis;
        }

        public int getSnapshotHistory() {
            return snapshotHistory;
        }

        public void setSnapshotHistory(int snapshotHistory) {
            this.snapshotHistory = snapshotHistory;
        }

        public String getLevelName() {
            return levelName;
        }

        public void setLevelName(String levelName) {
            this.levelName = levelName;
        }
    }

    /** 客户端上报移动的边界检查 + 预测用的积分参数 */
    public static class Movement {
        private double speedTolerance = 0.1;
        private double displacementSlack = 5.0;
        private double muzzleTolerance = 10.0;
        private double dragPerFrame = 0.97;
        // 加力：燃料每秒消耗/回充量，停止加力后多久开始回充（秒），加速度倍数
        private double boostDrainRate = 20.0;
        private double boostRegenRate = 33.0;
        private double boostRegenDelay = 3.0;
        private double boostMultiplier = 2.5;

        public double getSpeedTolerance() {
            return speedTolerance;
        }

        public void setSpeedTolerance(double speedTolerance) {
            this.speedTolerance = speedTolerance;
        }

        public double getDisplacementSlack() {
            return displacementSlack;
        }

        public void setDisplacementSlack(double displacementSlack) {
            this.displacementSlack = displacementSlack;
        }

        public double getMuzzleTolerance() {
            return muzzleTolerance;
        }

        public void setMuzzleTolerance(double muzzleTolerance) {
            this.muzzleTolerance = muzzleTolerance;
        }

        public double getDragPerFrame() {
            return dragPerFrame;
        }

        public void setDragPerFrame(double dragPerFrame) {
            this.dragPerFrame = dragPerFrame;
        }

        public double getBoostDrainRate() {
            return boostDrainRate;
        }

        public void setBoostDrainRate(double boostDrainRate) {
            this.boostDrainRate = boostDrainRate;
        }

        public double getBoostRegenRate() {
            return boostRegenRate;
        }

        public void setBoostRegenRate(double boostRegenRate) {
            this.boostRegenRate = boostRegenRate;
        }

        public double getBoostRegenDelay() {
            return boostRegenDelay;
        }

        public void setBoostRegenDelay(double boostRegenDelay) {
            this.boostRegenDelay = boostRegenDelay;
        }

        public double getBoostMultiplier() {
            return boostMultiplier;
        }

        public void setBoostMultiplier(double boostMultiplier) {
            this.boostMultiplier = boostMultiplier;
        }
    }

    public static class Combat {
        private double playerColliderRadius = 1.5;
        private double respawnDelay = 3.0;

        private double laserSpeed = 200.0;
        private double laserLifetime = 3.0;
        private int laserDamage = 10;
        private int upgradedLaserDamage = 15;
        private double laserRadius = 0.3;
        private double laserFireInterval = 0.15;

        private double missileSpeed = 60.0;
        private double missileLifetime = 8.0;
        private int missileDamage = 40;
        private double missileRadius = 0.6;
        private double missileFireInterval = 0.5;

        public double getPlayerColliderRadius() {
            return playerColliderRadius;
        }

        public void setPlayerColliderRadius(double playerColliderRadius) {
            this.playerColliderRadius = playerColliderRadius;
        }

        public double getRespawnDelay() {
            return respawnDelay;
        }

        public void setRespawnDelay(double respawnDelay) {
            this.respawnDelay = respawnDelay;
        }

        public double getLaserSpeed() {
            return laserSpeed;
        }

        public void setLaserSpeed(double laserSpeed) {
            this.laserSpeed = laserSpeed;
        }

        public double getLaserLifetime() {
            return laserLifetime;
        }

        public void setLaserLifetime(double laserLifetime) {
            this.laserLifetime = laserLifetime;
        }

        public int getLaserDamage() {
            return laserDamage;
        }

        public void setLaserDamage(int laserDamage) {
            this.laserDamage = laserDamage;
        }

        public int getUpgradedLaserDamage() {
            return upgradedLaserDamage;
        }

        public void setUpgradedLaserDamage(int upgradedLaserDamage) {
            this.upgradedLaserDamage = upgradedLaserDamage;
        }

        public double getLaserRadius() {
            return laserRadius;
        }

        public void setLaserRadius(double laserRadius) {
            this.laserRadius = laserRadius;
        }

        public double getLaserFireInterval() {
            return laserFireInterval;
        }

        public void setLaserFireInterval(double laserFireInterval) {
            this.laserFireInterval = laserFireInterval;
        }

        public double getMissileSpeed() {
            return missileSpeed;
        }

        public void setMissileSpeed(double missileSpeed) {
            this.missileSpeed = missileSpeed;
        }

        public double getMissileLifetime() {
            return missileLifetime;
        }

        public void setMissileLifetime(double missileLifetime) {
            this.missileLifetime = missileLifetime;
        }

        public int getMissileDamage() {
            return missileDamage;
        }

        public void setMissileDamage(int missileDamage) {
            this.missileDamage = missileDamage;
        }

        public double getMissileRadius() {
            return missileRadius;
        }

        public void setMissileRadius(double missileRadius) {
            this.missileRadius = missileRadius;
        }

        public double getMissileFireInterval() {
            return missileFireInterval;
        }

        public void setMissileFireInterval(double missileFireInterval) {
            this.missileFireInterval = missileFireInterval;
        }
    }

    /** 护盾回复：受伤后 regenDelay 秒开始，每秒 regenRate */
    public static class Shield {
        private double regenDelay = 5.0;
        private double regenRate = 15.0;

        public double getRegenDelay() {
            return regenDelay;
        }

        public void setRegenDelay(double regenDelay) {
            this.regenDelay = regenDelay;
        }

        public double getRegenRate() {
            return regenRate;
        }

        public void setRegenRate(double regenRate) {
            this.regenRate = regenRate;
        }
    }

    public static class Collectibles {
        private double respawnTime = 15.0;
        private double pickupRadius = 2.5;
        private int missileRefillAmount = 3;

        public double getRespawnTime() {
            return respawnTime;
        }

        public void setRespawnTime(double respawnTime) {
            this.respawnTime = respawnTime;
        }

        public double getPickupRadius() {
            return pickupRadius;
        }

        public void setPickupRadius(double pickupRadius) {
            this.pickupRadius = pickupRadius;
        }

        public int getMissileRefillAmount() {
            return missileRefillAmount;
        }

        public void setMissileRefillAmount(int missileRefillAmount) {
            this.missileRefillAmount = missileRefillAmount;
        }
    }

    /** 对局阶段：Lobby → Countdown → Playing → Results */
    public static class Phase {
        private int minPlayers = 2;
        private double countdownSeconds = 5.0;
        private double matchSeconds = 300.0;
        private double resultsSeconds = 10.0;
        private int scoreLimit = 10;

        public int getMinPlayers() {
            return minPlayers;
        }

        public void setMinPlayers(int minPlayers) {
            this.minPlayers = minPlayers;
        }

        public double getCountdownSeconds() {
            return countdownSeconds;
        }

        public void setCountdownSeconds(double countdownSeconds) {
            this.countdownSeconds = countdownSeconds;
        }

        public double getMatchSeconds() {
            return matchSeconds;
        }

        public void setMatchSeconds(double matchSeconds) {
            this.matchSeconds = matchSeconds;
        }

        public double getResultsSeconds() {
            return resultsSeconds;
        }

        public void setResultsSeconds(double resultsSeconds) {
            this.resultsSeconds = resultsSeconds;
        }

        public int getScoreLimit() {
            return scoreLimit;
        }

        public void setScoreLimit(int scoreLimit) {
            this.scoreLimit = scoreLimit;
        }
    }

    public static class Network {
        private long heartbeatTimeoutMillis = 10_000L;
        private int sendTimeLimitMillis = 2_000;
        private int sendBufferSizeLimit = 512 * 1024;
        private int outboundQueueLimit = 256;
        private int maxChatLength = 200;

        public long getHeartbeatTimeoutMillis() {
            return heartbeatTimeoutMillis;
        }

        public void setHeartbeatTimeoutMillis(long heartbeatTimeoutMillis) {
            this.heartbeatTimeoutMillis = heartbeatTimeoutMillis;
        }

        public int getSendTimeLimitMillis() {
            return sendTimeLimitMillis;
        }

        public void setSendTimeLimitMillis(int sendTimeLimitMillis) {
            this.sendTimeLimitMillis = sendTimeLimitMillis;
        }

        public int getSendBufferSizeLimit() {
            return sendBufferSizeLimit;
        }

        public void setSendBufferSizeLimit(int sendBufferSizeLimit) {
            this.sendBufferSizeLimit = sendBufferSizeLimit;
        }

        public int getOutboundQueueLimit() {
            return outboundQueueLimit;
        }

        public void setOutboundQueueLimit(int outboundQueueLimit) {
            this.outboundQueueLimit = outboundQueueLimit;
        }

        public int getMaxChatLength() {
            return maxChatLength;
        }

        public void setMaxChatLength(int maxChatLength) {
            this.maxChatLength = maxChatLength;
        }
    }

    /** 客户端预测校正 */
    public static class Reconciliation {
        private double threshold = 0.5;
        private long blendMillis = 200;
        private int historySize = 128;

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public long getBlendMillis() {
            return blendMillis;
        }

        public void setBlendMillis(long blendMillis) {
            this.blendMillis = blendMillis;
        }

        public int getHistorySize() {
            return historySize;
        }

        public void setHistorySize(int historySize) {
            this.historySize = historySize;
        }
    }

    public static class Admin {
        // 为空时禁用管理员重开接口
        private String token = "";

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }
    }
}

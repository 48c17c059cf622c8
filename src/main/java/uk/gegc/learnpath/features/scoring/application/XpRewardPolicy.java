package uk.gegc.learnpath.features.scoring.application;

/**
 * Step function from a challenge score to the XP it earns.
 */
public final class XpRewardPolicy {

    private XpRewardPolicy() {
    }

    public static int award(int score, int baseReward) {
        if (score >= 90) {
            return (int) Math.round(baseReward * 1.5);
        }
        if (score >= 80) {
            return (int) Math.round(baseReward * 1.2);
        }
        if (score >= 70) {
            return baseReward;
        }
        if (score >= 50) {
            return (int) Math.round(baseReward * 0.5);
        }
        return 0;
    }
}

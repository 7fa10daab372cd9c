package com.pbpreminder.bot.check;

import com.pbpreminder.bot.store.ArchiveRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Random;

/**
 * Runs the checks in a fixed order. A failing check is logged and skipped; the rest still run.
 */
public final class CheckOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(CheckOrchestrator.class);

    private final List<Check> checks;

    public CheckOrchestrator(List<Check> checks) {
        this.checks = List.copyOf(checks);
    }

    public static CheckOrchestrator standard(Random random, BoonCatalog boons, ArchiveRepository archive) {
        return new CheckOrchestrator(List.of(
                new TopicAlertCheck(),
                new PlayerActivityCheck(),
                new RosterCheck(),
                new AwardCheck(random, boons),
                new AwardExpiryCheck(),
                new PaceReportCheck(),
                new StreakMilestoneCheck(),
                new AnniversaryCheck(),
                new MessageMilestoneCheck(),
                new CombatPingCheck(),
                new LeaderboardCheck(),
                new DigestCheck(),
                new RecruitmentCheck(),
                new WeeklyArchiveCheck(archive),
                new PaceDropCheck(),
                new SilenceCheck()
        ));
    }

    public int runAll(CheckContext ctx) {
        int failed = 0;
        for (Check check : checks) {
            try {
                check.run(ctx);
            } catch (RuntimeException e) {
                failed++;
                log.error("Error in {}", check.label(), e);
            }
        }
        return failed;
    }

    public List<Check> checks() {
        return checks;
    }
}

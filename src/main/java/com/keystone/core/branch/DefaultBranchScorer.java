package com.keystone.core.branch;

import com.keystone.core.model.Artifact;
import com.keystone.core.model.BlockOutcome;
import com.keystone.core.model.RunReport;
import com.keystone.core.model.ValidationResult;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Heuristic scorer.
 * <ul>
 *   <li>functionality: share of blocks that completed</li>
 *   <li>quality: validation "quality" metric of completed blocks, lowered by issues</li>
 *   <li>performance: validation "performance" metric, else 1 / attempts</li>
 *   <li>maintainability: line-length discipline and moderate artifact size</li>
 * </ul>
 * Component scores average the producing block's quality and the artifact's maintainability.
 */
@Component
public class DefaultBranchScorer implements BranchScorer {

    static final int MAX_LINE_LENGTH = 120;
    static final int MODERATE_LINE_COUNT = 400;
    static final double UNVALIDATED_QUALITY = 0.5;

    @Override
    public BranchMetrics score(RunReport report, EvaluationWeights weights) {
        int total = report.blocks().size();
        if (total == 0) {
            return new BranchMetrics(0, 0, 0, 0, 0, Map.of());
        }

        double functionality = (double) report.successfulBlocks() / total;

        double quality = 0;
        double performance = 0;
        int succeeded = 0;
        var qualityByBlock = new HashMap<String, Double>();
        for (BlockOutcome outcome : report.outcomes().values()) {
            if (!outcome.status().isSuccessful()) {
                continue;
            }
            double q = blockQuality(outcome.validation());
            qualityByBlock.put(outcome.blockId(), q);
            quality += q;
            int attempts = Math.max(1, outcome.attempts());
            performance += outcome.validation() != null
                    ? clamp(outcome.validation().metric("performance", 1.0 / attempts))
                    : 1.0 / attempts;
            succeeded++;
        }
        if (succeeded > 0) {
            quality /= succeeded;
            performance /= succeeded;
        }

        double maintainability = 0;
        var components = new HashMap<String, Double>();
        for (Artifact artifact : report.artifacts().values()) {
            double m = maintainability(artifact.content());
            maintainability += m;
            double blockQuality = qualityByBlock.getOrDefault(artifact.blockId(), UNVALIDATED_QUALITY);
            components.put(artifact.path(), (blockQuality + m) / 2.0);
        }
        if (!report.artifacts().isEmpty()) {
            maintainability /= report.artifacts().size();
        }

        double overall = weights.overall(quality, functionality, performance, maintainability);
        return new BranchMetrics(quality, functionality, performance, maintainability, overall, components);
    }

    static double blockQuality(ValidationResult validation) {
        if (validation == null) {
            return UNVALIDATED_QUALITY;
        }
        double fallback = Math.max(0.5, 1.0 - 0.1 * validation.issues().size());
        return clamp(validation.metric("quality", fallback));
    }

    /**
     * Mean of the share of lines within {@link #MAX_LINE_LENGTH} and a size score that prefers
     * moderate artifacts: full marks up to {@link #MODERATE_LINE_COUNT} lines, decaying beyond.
     */
    static double maintainability(String content) {
        if (content == null || content.isBlank()) {
            return 0.0;
        }
        var lines = content.lines().toList();
        long shortLines = lines.stream().filter(l -> l.length() <= MAX_LINE_LENGTH).count();
        double lineScore = (double) shortLines / lines.size();
        double sizeScore = lines.size() <= MODERATE_LINE_COUNT ? 1.0 : (double) MODERATE_LINE_COUNT / lines.size();
        return (lineScore + sizeScore) / 2.0;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}

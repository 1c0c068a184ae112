package fr.lapetina.airouter.streaming;

import fr.lapetina.airouter.domain.model.FinishReason;
import fr.lapetina.airouter.domain.model.ResponseMetadata;
import fr.lapetina.airouter.domain.model.Usage;

import java.math.BigDecimal;
import java.util.List;

/**
 * Terminal summary of a completion stream.
 *
 * @param failed        true when the stream stopped on a read error rather than its natural end
 * @param failureDetail null unless failed
 * @param cost          null until the router prices it, or when pricing is unknown
 */
public record StreamSummary(
        String provider,
        String model,
        Usage usage,
        FinishReason finishReason,
        boolean failed,
        String failureDetail,
        BigDecimal cost,
        ResponseMetadata metadata
) {
    public StreamSummary {
        if (usage == null) {
            usage = Usage.EMPTY;
        }
        if (finishReason == null) {
            finishReason = failed ? FinishReason.ERROR : FinishReason.STOP;
        }
    }

    public StreamSummary withRouting(List<String> attemptedProviders, BigDecimal computedCost) {
        return new StreamSummary(provider, model, usage, finishReason, failed, failureDetail,
                computedCost, metadata.withRouting(attemptedProviders, computedCost != null));
    }
}

package io.swarmmesh.runtime;

import io.swarmmesh.config.SwarmSettings;
import io.swarmmesh.consensus.ProposalEvaluator;
import io.swarmmesh.distribution.AssignmentScorer;
import io.swarmmesh.distribution.FailurePolicy;
import io.swarmmesh.distribution.PhasedTaskDecomposer;
import io.swarmmesh.distribution.RebalanceAction;
import io.swarmmesh.distribution.SuccessPredictor;
import io.swarmmesh.distribution.TaskDecomposer;

import java.util.Random;

public record SwarmPolicies(
        AssignmentScorer scorer,
        SuccessPredictor predictor,
        ProposalEvaluator evaluator,
        FailurePolicy failurePolicy,
        RebalanceAction rebalanceAction,
        TaskDecomposer decomposer,
        Random random
) {
    public SwarmPolicies {
        scorer = scorer == null ? AssignmentScorer.weighted() : scorer;
        predictor = predictor == null ? SuccessPredictor.historical() : predictor;
        evaluator = evaluator == null ? ProposalEvaluator.alwaysAccept() : evaluator;
        failurePolicy = failurePolicy == null ? FailurePolicy.retryBudget() : failurePolicy;
        rebalanceAction = rebalanceAction == null ? RebalanceAction.logOnly() : rebalanceAction;
        decomposer = decomposer == null ? new PhasedTaskDecomposer() : decomposer;
        random = random == null ? new Random() : random;
    }

    public static SwarmPolicies defaults(SwarmSettings settings) {
        return new SwarmPolicies(
                null,
                null,
                ProposalEvaluator.fromSetting(settings.consensusPolicy()),
                null,
                RebalanceAction.fromSetting(settings.rebalanceStrategy()),
                null,
                null
        );
    }

    public SwarmPolicies withScorer(AssignmentScorer value) {
        return new SwarmPolicies(value, predictor, evaluator, failurePolicy, rebalanceAction, decomposer, random);
    }

    public SwarmPolicies withPredictor(SuccessPredictor value) {
        return new SwarmPolicies(scorer, value, evaluator, failurePolicy, rebalanceAction, decomposer, random);
    }

    public SwarmPolicies withEvaluator(ProposalEvaluator value) {
        return new SwarmPolicies(scorer, predictor, value, failurePolicy, rebalanceAction, decomposer, random);
    }

    public SwarmPolicies withFailurePolicy(FailurePolicy value) {
        return new SwarmPolicies(scorer, predictor, evaluator, value, rebalanceAction, decomposer, random);
    }

    public SwarmPolicies withRebalanceAction(RebalanceAction value) {
        return new SwarmPolicies(scorer, predictor, evaluator, failurePolicy, value, decomposer, random);
    }

    public SwarmPolicies withDecomposer(TaskDecomposer value) {
        return new SwarmPolicies(scorer, predictor, evaluator, failurePolicy, rebalanceAction, value, random);
    }

    public SwarmPolicies withRandom(Random value) {
        return new SwarmPolicies(scorer, predictor, evaluator, failurePolicy, rebalanceAction, decomposer, value);
    }
}

package com.iimsoft.jobqueue.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Weighted optimization goals. Weights are in [0,1] and conceptually sum near 1.0 (not enforced).
 */
public class OptimizationGoals {
    private PrimaryObjective primaryObjective = PrimaryObjective.BALANCE_WORKLOAD;
    private List<String> secondaryObjectives = new ArrayList<>();
    private double customerSatisfactionWeight;
    private double profitabilityWeight;
    private double efficiencyWeight;
    private double urgencyWeight;

    public OptimizationGoals() {}

    public OptimizationGoals(double customerSatisfactionWeight, double profitabilityWeight,
                             double efficiencyWeight, double urgencyWeight) {
        this.customerSatisfactionWeight = customerSatisfactionWeight;
        this.profitabilityWeight = profitabilityWeight;
        this.efficiencyWeight = efficiencyWeight;
        this.urgencyWeight = urgencyWeight;
    }

    /** Copy with another weight vector, keeping the objectives. */
    public OptimizationGoals withWeights(double customerSatisfactionWeight, double profitabilityWeight,
                                         double efficiencyWeight, double urgencyWeight) {
        OptimizationGoals copy = new OptimizationGoals(customerSatisfactionWeight, profitabilityWeight,
                efficiencyWeight, urgencyWeight);
        copy.setPrimaryObjective(primaryObjective);
        copy.setSecondaryObjectives(new ArrayList<>(secondaryObjectives));
        return copy;
    }

    public PrimaryObjective getPrimaryObjective() { return primaryObjective; }
    public void setPrimaryObjective(PrimaryObjective primaryObjective) { this.primaryObjective = primaryObjective; }
    public List<String> getSecondaryObjectives() { return secondaryObjectives; }
    public void setSecondaryObjectives(List<String> secondaryObjectives) { this.secondaryObjectives = secondaryObjectives; }
    public double getCustomerSatisfactionWeight() { return customerSatisfactionWeight; }
    public void setCustomerSatisfactionWeight(double customerSatisfactionWeight) { this.customerSatisfactionWeight = customerSatisfactionWeight; }
    public double getProfitabilityWeight() { return profitabilityWeight; }
    public void setProfitabilityWeight(double profitabilityWeight) { this.profitabilityWeight = profitabilityWeight; }
    public double getEfficiencyWeight() { return efficiencyWeight; }
    public void setEfficiencyWeight(double efficiencyWeight) { this.efficiencyWeight = efficiencyWeight; }
    public double getUrgencyWeight() { return urgencyWeight; }
    public void setUrgencyWeight(double urgencyWeight) { this.urgencyWeight = urgencyWeight; }
}

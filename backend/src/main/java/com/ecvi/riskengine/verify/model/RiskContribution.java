package com.ecvi.riskengine.verify.model;

public record RiskContribution(double weight, double confidence, double contribution) {}

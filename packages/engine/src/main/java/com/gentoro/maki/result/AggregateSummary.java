package com.gentoro.maki.result;

/** Narrative over all results of a run plus the recommended plan of actions. */
public record AggregateSummary(String summary, String plan) {}

package com.jz.crm.classifier;

import com.jz.crm.memory.ContextTurn;

import java.util.List;

/**
 * Reads one customer message (plus recent turns) and decides intent, handoff and reply.
 * Implementations never throw; failures come back as a verdict that asks for a human.
 */
public interface IntentClassifier {

    ClassifierVerdict classify(String message, List<ContextTurn> context, String customerName, boolean businessHours);
}

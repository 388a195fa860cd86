package com.fiscalpilot.core.executor;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link TransactionLedger}, used when no bookkeeping connector is wired in
 * and in tests. Transactions it has never seen are treated as uncategorized.
 */
public class InMemoryTransactionLedger implements TransactionLedger {

    private final ConcurrentHashMap<String, String> categories = new ConcurrentHashMap<>();

    public InMemoryTransactionLedger() {}

    public InMemoryTransactionLedger(Map<String, String> initial) {
        categories.putAll(initial);
    }

    @Override
    public Map<String, String> categoriesOf(Collection<String> transactionIds) {
        var result = new LinkedHashMap<String, String>();
        for (String id : transactionIds) {
            result.put(id, categories.getOrDefault(id, UNCATEGORIZED));
        }
        return result;
    }

    @Override
    public void updateCategories(Map<String, String> categoriesByTransaction) {
        categories.putAll(categoriesByTransaction);
    }

    public String categoryOf(String transactionId) {
        return categories.getOrDefault(transactionId, UNCATEGORIZED);
    }
}

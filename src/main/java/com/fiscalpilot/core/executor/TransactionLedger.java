package com.fiscalpilot.core.executor;

import java.util.Collection;
import java.util.Map;

/**
 * Write-back port into the bookkeeping system of record for transaction categories.
 */
public interface TransactionLedger {

    /**
     * Current category of each requested transaction. Unknown ids are absent from the result;
     * uncategorized transactions map to {@link #UNCATEGORIZED}.
     */
    Map<String, String> categoriesOf(Collection<String> transactionIds);

    /**
     * Sets the category of each transaction in the map.
     *
     * @throws ExecutorException if the system of record rejects the update
     */
    void updateCategories(Map<String, String> categoriesByTransaction);

    String UNCATEGORIZED = "uncategorized";
}

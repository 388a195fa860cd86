package com.fiscalpilot.core.executor;

import com.fiscalpilot.core.model.ExecutionErrors;
import com.fiscalpilot.core.model.ExecutionResult;
import com.fiscalpilot.core.model.ProposedAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Categorizes and tags transactions through the {@link TransactionLedger}.
 * <p>
 * Parameters: {@code transaction_ids} (list) and {@code category}. A real run captures the
 * previous category of every touched transaction under {@code original_categories} so the
 * change can be rolled back.
 */
public class CategorizationExecutor implements ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(CategorizationExecutor.class);

    public static final String NAME = "categorization";
    static final String ORIGINAL_CATEGORIES = "original_categories";

    private final TransactionLedger ledger;

    public CategorizationExecutor(TransactionLedger ledger) {
        this.ledger = ledger;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Categorizes and tags transactions";
    }

    @Override
    public Set<String> supportedActionTypes() {
        return Set.of("categorize_transaction", "tag_expense", "update_category_bulk");
    }

    @Override
    public ValidationResult validate(ProposedAction action) {
        boolean hasIds = !action.stringListParameter("transaction_ids").isEmpty();
        String category = action.stringParameter("category");
        boolean hasCategory = category != null && !category.isBlank();
        if (!hasIds && !hasCategory) {
            return ValidationResult.invalid("Missing required parameters: transaction_ids and category");
        }
        if (!hasIds) {
            return ValidationResult.invalid("Missing required parameter: transaction_ids");
        }
        if (!hasCategory) {
            return ValidationResult.invalid("Missing required parameter: category");
        }
        return ValidationResult.ok();
    }

    @Override
    public ExecutionResult execute(ProposedAction action, boolean dryRun) {
        List<String> txnIds = action.stringListParameter("transaction_ids");
        String category = action.stringParameter("category");

        var details = new LinkedHashMap<String, Object>();
        details.put("transaction_ids", txnIds);
        details.put("category", category);
        details.put("count", txnIds.size());

        if (dryRun) {
            String summary = String.format("Would categorize %d transaction(s) as '%s'", txnIds.size(), category);
            return ExecutionResult.completed(action.getId(), summary, details, true, false);
        }

        Map<String, String> original = ledger.categoriesOf(txnIds);
        var updates = new LinkedHashMap<String, String>();
        for (String id : txnIds) {
            updates.put(id, category);
        }
        ledger.updateCategories(updates);

        String summary = String.format("Categorized %d transaction(s) as '%s'", txnIds.size(), category);
        log.info(summary);
        details.put(ORIGINAL_CATEGORIES, Map.copyOf(original));
        return ExecutionResult.completed(action.getId(), summary, details, false, true);
    }

    @Override
    public ExecutionResult rollback(ProposedAction action, ExecutionResult priorResult) {
        Map<String, String> original = originalCategories(priorResult);
        if (original.isEmpty()) {
            return ExecutionResult.failed(action.getId(),
                    "Cannot rollback: original categories not saved.",
                    ExecutionErrors.NO_ORIGINAL_DATA, false);
        }

        ledger.updateCategories(original);
        log.info("Restored {} transaction categories for action {}", original.size(), action.getId());
        return ExecutionResult.rolledBack(action.getId(),
                String.format("Rolled back %d transaction categories to originals", original.size()),
                Map.of(ORIGINAL_CATEGORIES, original));
    }

    private static Map<String, String> originalCategories(ExecutionResult result) {
        Object raw = result.details().get(ORIGINAL_CATEGORIES);
        if (!(raw instanceof Map<?, ?> map)) {
            return Map.of();
        }
        var categories = new LinkedHashMap<String, String>();
        map.forEach((k, v) -> categories.put(String.valueOf(k), String.valueOf(v)));
        return categories;
    }
}

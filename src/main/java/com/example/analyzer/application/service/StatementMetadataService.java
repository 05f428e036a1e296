package com.example.analyzer.application.service;

import com.example.analyzer.domain.model.Statement;
import com.example.analyzer.infrastructure.config.BankSchemaRegistry;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens statement headers and footers into one record per uploaded statement.
 */
@Service
public class StatementMetadataService {

    static final Map<String, String> HEADER_FIELDS = headerFields();
    static final String TOTAL_DEBIT_TURNOVER = "total_debit_turnover";
    static final String TOTAL_CREDIT_TURNOVER = "total_credit_turnover";

    private final BankSchemaRegistry registry;

    public StatementMetadataService(BankSchemaRegistry registry) {
        this.registry = registry;
    }

    public List<Map<String, Object>> toRecords(List<Statement> statements) {
        if (statements == null) {
            return List.of();
        }
        return statements.stream().map(this::toRecord).toList();
    }

	/**
	 * Builds the metadata record of one statement: identity fields, known header extras under English
	 * keys, then the footer records and the first footer record's turnover totals.
	 *
	 * @param statement parsed statement
	 * @return ordered record
	 */
    public Map<String, Object> toRecord(Statement statement) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("statement_id", statement.statementId());
        record.put("bank", statement.bank());
        record.put("bank_name", registry.schemaFor(statement.bank()).displayName());
        record.put("account_holder_name", statement.holderName());
        record.put("holder_id", statement.holderId());
        record.put("account_number", statement.accountNumber());
        record.put("period_from", statement.periodFrom());
        record.put("period_to", statement.periodTo());
        record.put("statement_generation_date", statement.generationDate());

        HEADER_FIELDS.forEach((source, target) -> {
            String value = statement.header().get(source);
            if (value != null) {
                record.put(target, value.strip());
            }
        });

        List<Map<String, String>> footer = statement.footer().records();
        record.put("footer_records", footer);
        if (!footer.isEmpty()) {
            Map<String, String> first = footer.get(0);
            if (first.containsKey(TOTAL_DEBIT_TURNOVER)) {
                record.put(TOTAL_DEBIT_TURNOVER, first.get(TOTAL_DEBIT_TURNOVER));
            }
            if (first.containsKey(TOTAL_CREDIT_TURNOVER)) {
                record.put(TOTAL_CREDIT_TURNOVER, first.get(TOTAL_CREDIT_TURNOVER));
            }
        }
        return record;
    }

    private static Map<String, String> headerFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("Валюта", "currency");
        fields.put("БИК", "bic");
        fields.put("Кредитный лимит", "credit_limit");
        fields.put("Входящий остаток", "opening_balance");
        fields.put("Входящее сальдо", "incoming_saldo");
        fields.put("Реальный баланс", "real_balance");
        fields.put("Блокированные средства", "blocked_funds");
        return fields;
    }
}

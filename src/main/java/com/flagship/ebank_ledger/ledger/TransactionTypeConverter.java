package com.flagship.ebank_ledger.ledger;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link TransactionType} by its wire value ("withdrawal-to-wallet")
 * rather than the enum constant name.
 */
@Converter
public class TransactionTypeConverter implements AttributeConverter<TransactionType, String> {

    @Override
    public String convertToDatabaseColumn(TransactionType type) {
        return type != null ? type.getWireValue() : null;
    }

    @Override
    public TransactionType convertToEntityAttribute(String value) {
        return value != null ? TransactionType.fromWireValue(value) : null;
    }
}

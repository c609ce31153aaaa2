package com.procurement.contract;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ContractStatus {
    CONTRACT("Contract"),
    NON_CONTRACT("Non-Contract");

    private final String label;

    ContractStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}

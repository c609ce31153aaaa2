package com.procurement.contract;

public enum RiskLevel {
    HIGH,
    MEDIUM,
    LOW
}

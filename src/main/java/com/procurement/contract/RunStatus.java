package com.procurement.contract;

public enum RunStatus {
    SUCCEEDED,
    FAILED
}

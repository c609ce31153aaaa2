package com.procurement.gate;

import com.procurement.contract.AcceptedTransaction;
import com.procurement.contract.RejectedTransaction;

import java.util.List;

public record GateResult(
    List<AcceptedTransaction> accepted,
    List<RejectedTransaction> rejected
) {

    public GateResult {
        accepted = List.copyOf(accepted);
        rejected = List.copyOf(rejected);
    }

    public int total() {
        return accepted.size() + rejected.size();
    }
}

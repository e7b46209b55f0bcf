package com.library.circulation.dto.response;

public record SweepResultResponse(int promoted, int blacklisted, int unblacklisted) {

    public boolean hasEffects() {
        return promoted > 0 || blacklisted > 0 || unblacklisted > 0;
    }
}

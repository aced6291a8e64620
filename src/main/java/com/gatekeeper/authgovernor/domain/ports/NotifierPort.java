package com.gatekeeper.authgovernor.domain.ports;

import com.gatekeeper.authgovernor.domain.BlockInfo;

public interface NotifierPort {

    void blockCreated(String phoneNumber, BlockInfo blockInfo);

    void passwordResetCodeIssued(String phoneNumber, String code);
}

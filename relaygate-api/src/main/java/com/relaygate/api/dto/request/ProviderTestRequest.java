package com.relaygate.api.dto.request;

import lombok.Data;

@Data
public class ProviderTestRequest {

    private String message; // provider-specific greeting when blank
}

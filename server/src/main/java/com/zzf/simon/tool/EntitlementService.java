package com.zzf.simon.tool;

import com.zzf.simon.config.SimonProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Tier check for tools configured as pro-only.
 */
@Service
@RequiredArgsConstructor
public class EntitlementService {
    private final SimonProperties properties;

    public boolean isEntitled(String uid, String toolId) {
        SimonProperties.Entitlements entitlements = properties.getTools().getEntitlements();
        if (!entitlements.getProOnly().contains(toolId)) {
            return true;
        }
        return entitlements.getProUsers().contains(uid);
    }
}

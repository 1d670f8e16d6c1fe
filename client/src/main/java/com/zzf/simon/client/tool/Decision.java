package com.zzf.simon.client.tool;

public enum Decision {
    ACCEPT,
    DECLINE
}

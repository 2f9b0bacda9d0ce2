package com.example.accessgrant.model;

/** 重複 grant の best-effort 失効に失敗した grant と、その理由。 */
public record RepairFailure(String grantId, String reason) {}

package com.ivamare.campaign.splittest;

public enum Variant {
    A,
    B
}

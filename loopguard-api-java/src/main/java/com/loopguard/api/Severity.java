package com.loopguard.api;

import com.google.gson.annotations.SerializedName;

public enum Severity {
    @SerializedName("error")   ERROR,
    @SerializedName("warning") WARNING
}

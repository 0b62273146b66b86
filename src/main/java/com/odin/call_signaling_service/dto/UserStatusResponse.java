package com.odin.call_signaling_service.dto;

public class UserStatusResponse {
    private boolean reachable;
    private String pod;

    public UserStatusResponse() {}

    public UserStatusResponse(boolean reachable, String pod) {
        this.reachable = reachable;
        this.pod = pod;
    }

    public boolean isReachable() {
        return reachable;
    }

    public void setReachable(boolean reachable) {
        this.reachable = reachable;
    }

    public String getPod() {
        return pod;
    }

    public void setPod(String pod) {
        this.pod = pod;
    }
}

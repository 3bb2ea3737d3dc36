package me.go_gradually.voicelive.application.shared.policy;

public interface DataDirProvider {
    String getDataDir();
}

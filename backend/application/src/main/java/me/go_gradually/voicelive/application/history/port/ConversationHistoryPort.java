package me.go_gradually.voicelive.application.history.port;

import me.go_gradually.voicelive.application.history.model.HistoryMessage;

import java.util.List;

public interface ConversationHistoryPort {
    List<HistoryMessage> getProfile(String userId) throws Exception;

    void saveProfile(String userId, List<HistoryMessage> history) throws Exception;
}

package com.linlay.analysisagent.agent;

import com.linlay.analysisagent.llm.model.ChatMessage;
import com.linlay.analysisagent.sandbox.DataTable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionTest {

    @Test
    void shouldRejectBlankIdAndGenerateShortIds() {
        assertThatThrownBy(() -> new Session(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThat(new Session().id()).hasSize(12);
        assertThat(new Session(" s1 ").id()).isEqualTo("s1");
    }

    @Test
    void shouldExposeHistoryAsSnapshot() {
        Session session = new Session("s1");
        session.addUserMessage("hi");
        List<ChatMessage> snapshot = session.messages();

        session.addAssistantMessage("hello");
        session.addMessage(null);

        assertThat(snapshot).hasSize(1);
        assertThat(session.messageCount()).isEqualTo(2);
        assertThat(session.lastMessage().content()).isEqualTo("hello");
    }

    @Test
    void shouldKeepNotesOutOfDialog() {
        Session session = new Session("s1");
        session.addNote("chart", "volcano.png", Map.of("path", "/tmp/volcano.png"));

        assertThat(session.lastMessage().isDialog()).isFalse();
        assertThat(session.lastMessage().metadata()).containsEntry("path", "/tmp/volcano.png");
    }

    @Test
    void shouldJoinCompressedContextAndCountCompressions() {
        Session session = new Session("s1");
        session.appendCompressedContext("first");
        session.appendCompressedContext("  ");
        session.appendCompressedContext("second ");

        assertThat(session.compressedContext()).isEqualTo("first" + Session.CONTEXT_SEPARATOR + "second");
        assertThat(session.compressionCount()).isEqualTo(2);
        assertThat(session.lastCompressedAt()).isNotNull();
    }

    @Test
    void shouldManageDatasets() {
        Session session = new Session("s1");
        DataTable table = DataTable.of(List.of("gene"), List.of(List.<Object>of("TP53")));

        session.putDataset(" expr ", table);

        assertThat(session.hasDataset("expr")).isTrue();
        assertThat(session.dataset("expr")).isEqualTo(table);
        assertThat(session.datasets()).containsOnlyKeys("expr");
        assertThatThrownBy(() -> session.putDataset("", table)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> session.datasets().clear()).isInstanceOf(UnsupportedOperationException.class);

        session.removeDataset("expr");
        assertThat(session.hasDataset("expr")).isFalse();
    }
}

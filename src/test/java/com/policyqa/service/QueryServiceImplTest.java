package com.policyqa.service;

import com.policyqa.agent.orchestration.QueryCommand;
import com.policyqa.agent.orchestration.QueryExecution;
import com.policyqa.agent.orchestration.QueryOrchestrator;
import com.policyqa.exception.DocumentNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueryServiceImplTest {

    @Mock
    private DocumentService documentService;

    @Mock
    private QueryOrchestrator orchestrator;

    @InjectMocks
    private QueryServiceImpl queryService;

    @Test
    @DisplayName("Should check ownership of scoped documents before submitting")
    void shouldCheckScopeOwnership() {
        QueryCommand command = new QueryCommand(1L, "knee surgery", List.of(3L), null, false);
        QueryExecution execution = Mockito.mock(QueryExecution.class);
        when(orchestrator.submit(command)).thenReturn(execution);

        assertThat(queryService.submit(command)).isSameAs(execution);
        verify(documentService).requireOwned(1L, List.of(3L));
    }

    @Test
    @DisplayName("Should not submit when a scoped document is not owned")
    void shouldRejectForeignScope() {
        QueryCommand command = new QueryCommand(1L, "knee surgery", List.of(3L), null, false);
        doThrow(new DocumentNotFoundException(3L)).when(documentService).requireOwned(anyLong(), anyCollection());

        assertThatThrownBy(() -> queryService.submit(command)).isInstanceOf(DocumentNotFoundException.class);
        verify(orchestrator, never()).submit(any());
    }

    @Test
    @DisplayName("Should skip the ownership check for unscoped queries")
    void shouldSkipCheckWithoutScope() {
        QueryCommand command = new QueryCommand(1L, "knee surgery", null, null, false);
        when(orchestrator.submit(command)).thenReturn(Mockito.mock(QueryExecution.class));

        queryService.submit(command);

        verify(documentService, never()).requireOwned(any(), any());
    }
}

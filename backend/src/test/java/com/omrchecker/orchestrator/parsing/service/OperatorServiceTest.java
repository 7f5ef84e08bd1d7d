package com.omrchecker.orchestrator.parsing.service;

import com.omrchecker.orchestrator.parsing.model.Operator;
import com.omrchecker.orchestrator.parsing.persistence.OperatorRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OperatorServiceTest {

    @Mock
    private OperatorRepository repository;

    @Test
    void registerGeneratesTokenWhenAbsent() {
        when(repository.create(any(Operator.class))).thenAnswer(invocation -> invocation.getArgument(0));
        OperatorService service = new OperatorService(repository);

        Operator created = service.register(" https://example.com/hook ", null);

        ArgumentCaptor<Operator> captor = ArgumentCaptor.forClass(Operator.class);
        verify(repository).create(captor.capture());
        assertThat(captor.getValue().callbackUrl()).isEqualTo("https://example.com/hook");
        assertThat(UUID.fromString(created.token())).isNotNull();
        assertThat(created.id()).isNotEqualTo(created.token());
    }

    @Test
    void registerKeepsExplicitToken() {
        when(repository.create(any(Operator.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Operator created = new OperatorService(repository).register("http://hooks.local/omr", "test-uuid");

        assertThat(created.token()).isEqualTo("test-uuid");
    }

    @Test
    void callbackUrlMustBeAbsoluteHttp() {
        OperatorService service = new OperatorService(repository);

        assertThatThrownBy(() -> service.register("ftp://example.com/hook", null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.register("/relative", null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.register("", null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.updateCallbackUrl("op", "not a url")).isInstanceOf(IllegalArgumentException.class);
        verify(repository, never()).create(any(Operator.class));
        verify(repository, never()).updateCallbackUrl(anyString(), anyString());
    }

    @Test
    void updateAndDeleteDelegateToRepository() {
        when(repository.updateCallbackUrl("op", "https://example.com/new")).thenReturn(true);
        when(repository.delete("op")).thenReturn(true);
        OperatorService service = new OperatorService(repository);

        assertThat(service.updateCallbackUrl("op", "https://example.com/new")).isTrue();
        assertThat(service.delete("op")).isTrue();
    }
}

package zoho.contacts.app.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import zoho.contacts.app.config.ExtractorProperties;
import zoho.contacts.app.entity.MessagePage;
import zoho.contacts.app.entity.RawMessage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MessagePaginationServiceTest {

    @Mock
    private MailApiService mailApiService;

    private ExtractorProperties properties;
    private List<Long> sleeps;

    @BeforeEach
    void setUp() {
        properties = new ExtractorProperties();
        properties.getPagination().setPageSize(3);
        sleeps = new ArrayList<>();
    }

    private MessagePaginationService service() {
        return new MessagePaginationService(mailApiService, properties, sleeps::add);
    }

    private static MessagePage page(int start, int size) {
        List<RawMessage> messages = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            ObjectNode record = JsonNodeFactory.instance.objectNode();
            record.put("fromAddress", "sender" + (start + i) + "@example.com");
            messages.add(RawMessage.inline(record));
        }
        return new MessagePage(start, messages, 0);
    }

    private static List<RawMessage> drain(MessagePaginationService.PageIterator pages) {
        List<RawMessage> messages = new ArrayList<>();
        pages.forEachRemaining(page -> messages.addAll(page.getMessages()));
        return messages;
    }

    @Test
    void open_WithShortPage_ShouldStopWithoutFurtherRequest() {
        // Given
        when(mailApiService.listFolderMessages("111", "1", 0, 3)).thenReturn(page(0, 3));
        when(mailApiService.listFolderMessages("111", "1", 3, 3)).thenReturn(page(3, 2));

        // When
        MessagePaginationService.PageIterator pages = service().open("111", "1");
        List<MessagePage> fetched = new ArrayList<>();
        while (pages.hasNext()) {
            fetched.add(pages.next());
        }

        // Then
        assertEquals(2, fetched.size());
        assertEquals(5, pages.getProcessedCount());
        verify(mailApiService, times(2)).listFolderMessages(eq("111"), eq("1"), anyInt(), anyInt());
        verifyNoMoreInteractions(mailApiService);
        assertEquals(List.of(1000L), sleeps);
    }

    @Test
    void open_WithEmptyPage_ShouldStop() {
        // Given
        when(mailApiService.listFolderMessages("111", "1", 0, 3)).thenReturn(page(0, 3));
        when(mailApiService.listFolderMessages("111", "1", 3, 3)).thenReturn(page(3, 0));

        // When
        MessagePaginationService.PageIterator pages = service().open("111", "1");
        pages.next();

        // Then
        assertFalse(pages.hasNext());
        assertFalse(pages.hasNext());
        assertThrows(NoSuchElementException.class, pages::next);
        verify(mailApiService, times(2)).listFolderMessages(eq("111"), eq("1"), anyInt(), anyInt());
    }

    @Test
    void open_ShouldStopAtProcessedCeiling() {
        // Given
        properties.getPagination().setMaxMessages(6);
        when(mailApiService.listFolderMessages(eq("111"), eq("1"), anyInt(), eq(3)))
                .thenAnswer(invocation -> page(invocation.<Integer>getArgument(2), 3));

        // When
        List<RawMessage> messages = drain(service().open("111", "1"));

        // Then
        assertEquals(6, messages.size());
        verify(mailApiService).listFolderMessages("111", "1", 0, 3);
        verify(mailApiService).listFolderMessages("111", "1", 3, 3);
        verifyNoMoreInteractions(mailApiService);
    }

    @Test
    void open_WithoutFolder_ShouldUseSearchListing() {
        // Given
        when(mailApiService.searchMessages("111", 0, 3)).thenReturn(page(0, 1));

        // When
        List<RawMessage> messages = drain(service().open("111", null));

        // Then
        assertEquals(1, messages.size());
        verify(mailApiService, never()).listFolderMessages(anyString(), anyString(), anyInt(), anyInt());
    }

    @Test
    void open_WhenFolderListingFails_ShouldRetrySamePageViaSearch() {
        // Given
        when(mailApiService.listFolderMessages("111", "1", 0, 3)).thenThrow(new MailApiException("Failed", 500));
        when(mailApiService.searchMessages("111", 0, 3)).thenReturn(page(0, 2));

        // When
        MessagePaginationService.PageIterator pages = service().open("111", "1");
        MessagePage first = pages.next();

        // Then
        assertEquals(2, first.size());
        assertFalse(pages.hasNext());
        verify(mailApiService).searchMessages("111", 0, 3);
    }

    @Test
    void open_WhenBothListingsFail_ShouldPropagate() {
        // Given
        when(mailApiService.listFolderMessages("111", "1", 0, 3)).thenThrow(new MailApiException("Failed", 500));
        when(mailApiService.searchMessages("111", 0, 3)).thenThrow(ApiRequestException.exhausted(
                ApiRequestException.Kind.SERVER_ERROR, 4, "accounts/111/messages/search", null));

        // When & Then
        MessagePaginationService.PageIterator pages = service().open("111", "1");
        assertThrows(ApiRequestException.class, pages::hasNext);
    }

    @Test
    void open_ShouldRecordReportedTotal() {
        // Given
        MessagePage withTotal = new MessagePage(0, Collections.singletonList(page(0, 1).getMessages().get(0)), 240);
        when(mailApiService.listFolderMessages("111", "1", 0, 3)).thenReturn(withTotal);

        // When
        MessagePaginationService.PageIterator pages = service().open("111", "1");
        pages.next();

        // Then
        assertEquals(240, pages.getTotalKnown());
    }
}

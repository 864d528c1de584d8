package com.listinglab.scraper.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.listinglab.scraper.model.ScrapeRequest;
import com.listinglab.scraper.service.ListingIngestionService;
import com.listinglab.scraper.store.StoreException;
import com.rabbitmq.client.Channel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScrapeRequestConsumerTest {

    private static final long TAG = 7L;

    @Mock
    private ListingIngestionService ingestionService;

    @Mock
    private Channel channel;

    private ConsumerStats stats;
    private ScrapeRequestConsumer consumer;

    @BeforeEach
    void setUp() {
        stats = new ConsumerStats();
        consumer = new ScrapeRequestConsumer(new ScrapeRequestReader(new ObjectMapper()), ingestionService, stats);
    }

    private static Message message(String body) {
        MessageProperties properties = new MessageProperties();
        properties.setDeliveryTag(TAG);
        return new Message(body.getBytes(StandardCharsets.UTF_8), properties);
    }

    @Test
    void successfulScrapeIsAcknowledgedOnce() throws Exception {
        when(ingestionService.ingest(any())).thenReturn(List.of(11L));

        consumer.onMessage(message("{\"location\": \"Austin, TX\", \"limit\": 3}"), channel);

        ArgumentCaptor<ScrapeRequest> captor = ArgumentCaptor.forClass(ScrapeRequest.class);
        verify(ingestionService).ingest(captor.capture());
        assertThat(captor.getValue().getLimit()).isEqualTo(3);
        verify(channel).basicAck(TAG, false);
        verify(channel, never()).basicReject(anyLong(), anyBoolean());
        assertThat(stats.getAcknowledged()).isEqualTo(1);
    }

    @Test
    void unusableMessageIsAcknowledgedAndDropped() throws Exception {
        consumer.onMessage(message("{\"listing_type\": \"for_sale\"}"), channel);

        verifyNoInteractions(ingestionService);
        verify(channel).basicAck(TAG, false);
        assertThat(stats.getDropped()).isEqualTo(1);
        assertThat(stats.getAcknowledged()).isZero();
    }

    @Test
    void oversizedLimitIsAcknowledgedAndDropped() throws Exception {
        consumer.onMessage(message("{\"location\": \"Austin, TX\", \"limit\": 3000000000}"), channel);

        verifyNoInteractions(ingestionService);
        verify(channel).basicAck(TAG, false);
        verify(channel, never()).basicReject(anyLong(), anyBoolean());
        assertThat(stats.getDropped()).isEqualTo(1);
    }

    @Test
    void unexpectedReaderErrorStillSettlesTheMessage() throws Exception {
        ScrapeRequestReader reader = mock(ScrapeRequestReader.class);
        when(reader.read(any())).thenThrow(new IllegalArgumentException("unexpected token"));
        consumer = new ScrapeRequestConsumer(reader, ingestionService, stats);

        consumer.onMessage(message("{\"location\": \"Austin, TX\"}"), channel);

        verifyNoInteractions(ingestionService);
        verify(channel).basicAck(TAG, false);
        assertThat(stats.getDropped()).isEqualTo(1);
    }

    @Test
    void processingFailureRejectsWithoutRequeue() throws Exception {
        when(ingestionService.ingest(any())).thenThrow(new StoreException("real_estate.listing/create failed: 500"));

        consumer.onMessage(message("{\"location\": \"Austin, TX\"}"), channel);

        verify(channel).basicReject(TAG, false);
        verify(channel, never()).basicAck(anyLong(), anyBoolean());
        assertThat(stats.snapshot())
                .containsEntry("rejected", 1L)
                .containsEntry("acknowledged", 0L);
    }
}

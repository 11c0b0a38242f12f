package dev.contentscanner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ContentScannerApplicationTests {

    @Mock
    private QueueConsumerRunner queueConsumerRunner;

    @Test
    void shouldStartQueueConsumerOnRun() {
        ContentScannerApplication app = new ContentScannerApplication(queueConsumerRunner);

        app.run();

        verify(queueConsumerRunner).start();
    }
}

package se.artisan_be.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import se.artisan_be.dto.response.SubscriptionResult;
import se.artisan_be.exception.BadRequestException;
import se.artisan_be.exception.DuplicateResourceException;
import se.artisan_be.exception.ResourceNotFoundException;
import se.artisan_be.pojo.EmailSubscription;
import se.artisan_be.repository.EmailSubscriptionRepository;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SubscriptionServiceTest {

    @Mock
    private EmailSubscriptionRepository emailSubscriptionRepository;

    @Mock
    private MailService mailService;

    @InjectMocks
    private SubscriptionService subscriptionService;

    @Test
    void subscribe_newAddress_isStoredAndThanked() {
        // Arrange
        when(emailSubscriptionRepository.findByEmailAddressIgnoreCase("ana@example.com")).thenReturn(Optional.empty());
        when(emailSubscriptionRepository.save(any(EmailSubscription.class))).thenAnswer(invocation -> {
            EmailSubscription saved = invocation.getArgument(0);
            saved.setId(5L);
            return saved;
        });

        // Act
        SubscriptionResult result = subscriptionService.subscribe(" ana@example.com ");

        // Assert
        assertEquals(5L, result.getId());
        assertFalse(result.isReactivated());
        verify(mailService).sendSubscriptionThanks("ana@example.com");
    }

    @Test
    void subscribe_activeAddress_isConflict() {
        EmailSubscription existing = EmailSubscription.builder().id(1L).emailAddress("ana@example.com").isActive(true).build();
        when(emailSubscriptionRepository.findByEmailAddressIgnoreCase("ana@example.com")).thenReturn(Optional.of(existing));

        assertThrows(DuplicateResourceException.class, () -> subscriptionService.subscribe("ana@example.com"));

        verify(emailSubscriptionRepository, never()).save(any());
        verifyNoInteractions(mailService);
    }

    @Test
    void subscribe_inactiveAddress_isReactivatedWithoutMail() {
        // Arrange
        EmailSubscription existing = EmailSubscription.builder().id(1L).emailAddress("ana@example.com").isActive(false).build();
        when(emailSubscriptionRepository.findByEmailAddressIgnoreCase("ana@example.com")).thenReturn(Optional.of(existing));

        // Act
        SubscriptionResult result = subscriptionService.subscribe("ana@example.com");

        // Assert
        assertTrue(result.isReactivated());
        ArgumentCaptor<EmailSubscription> captor = ArgumentCaptor.forClass(EmailSubscription.class);
        verify(emailSubscriptionRepository).save(captor.capture());
        assertTrue(captor.getValue().getIsActive());
        verifyNoInteractions(mailService);
    }

    @Test
    void unsubscribe_unknownAddress_isNotFound() {
        when(emailSubscriptionRepository.findByEmailAddressIgnoreCase("who@example.com")).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> subscriptionService.unsubscribe("who@example.com"));
    }

    @Test
    void unsubscribe_missingAddress_isBadRequest() {
        assertThrows(BadRequestException.class, () -> subscriptionService.unsubscribe(" "));

        verifyNoInteractions(emailSubscriptionRepository);
    }

    @Test
    void unsubscribe_deactivates() {
        EmailSubscription existing = EmailSubscription.builder().id(1L).emailAddress("ana@example.com").isActive(true).build();
        when(emailSubscriptionRepository.findByEmailAddressIgnoreCase("ana@example.com")).thenReturn(Optional.of(existing));

        subscriptionService.unsubscribe("ana@example.com");

        assertFalse(existing.getIsActive());
        verify(emailSubscriptionRepository).save(existing);
    }
}

package se.artisan_be.service;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.artisan_be.dto.response.SubscriptionResult;
import se.artisan_be.exception.BadRequestException;
import se.artisan_be.exception.DuplicateResourceException;
import se.artisan_be.exception.ResourceNotFoundException;
import se.artisan_be.pojo.EmailSubscription;
import se.artisan_be.repository.EmailSubscriptionRepository;

import java.util.List;
import java.util.Optional;

@Service
@AllArgsConstructor
@Slf4j
public class SubscriptionService {
    private final EmailSubscriptionRepository emailSubscriptionRepository;
    private final MailService mailService;

    public List<EmailSubscription> findAll() {
        return emailSubscriptionRepository.findAllByOrderBySubscriptionDateDesc();
    }

    public List<EmailSubscription> findActive() {
        return emailSubscriptionRepository.findByIsActiveTrueOrderBySubscriptionDateDesc();
    }

    /**
     * New addresses are stored and thanked by mail. An inactive address is reactivated; an active one is a conflict.
     */
    @Transactional
    public SubscriptionResult subscribe(String emailAddress) {
        String email = emailAddress.trim();
        Optional<EmailSubscription> existing = emailSubscriptionRepository.findByEmailAddressIgnoreCase(email);
        if (existing.isPresent()) {
            EmailSubscription subscription = existing.get();
            if (Boolean.TRUE.equals(subscription.getIsActive())) {
                throw new DuplicateResourceException("This email is already subscribed");
            }
            subscription.setIsActive(true);
            emailSubscriptionRepository.save(subscription);
            log.info("Subscription {} reactivated", subscription.getId());
            return SubscriptionResult.builder()
                    .id(subscription.getId())
                    .emailAddress(subscription.getEmailAddress())
                    .reactivated(true)
                    .build();
        }

        EmailSubscription saved = emailSubscriptionRepository.save(EmailSubscription.builder()
                .emailAddress(email)
                .isActive(true)
                .build());
        log.info("Subscription {} created", saved.getId());
        mailService.sendSubscriptionThanks(saved.getEmailAddress());
        return SubscriptionResult.builder()
                .id(saved.getId())
                .emailAddress(saved.getEmailAddress())
                .reactivated(false)
                .build();
    }

    @Transactional
    public void unsubscribe(String emailAddress) {
        if (emailAddress == null || emailAddress.isBlank()) {
            throw new BadRequestException("Email address is required");
        }
        EmailSubscription subscription = emailSubscriptionRepository.findByEmailAddressIgnoreCase(emailAddress.trim())
                .orElseThrow(() -> new ResourceNotFoundException("No subscription found for this email address"));
        subscription.setIsActive(false);
        emailSubscriptionRepository.save(subscription);
        log.info("Subscription {} deactivated", subscription.getId());
    }

    @Transactional
    public void delete(Long id) {
        if (!emailSubscriptionRepository.existsById(id)) {
            throw new ResourceNotFoundException("Subscription", id);
        }
        emailSubscriptionRepository.deleteById(id);
        log.info("Subscription {} deleted", id);
    }
}

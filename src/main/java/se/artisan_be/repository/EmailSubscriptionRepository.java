package se.artisan_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.artisan_be.pojo.EmailSubscription;

import java.util.List;
import java.util.Optional;

public interface EmailSubscriptionRepository extends JpaRepository<EmailSubscription, Long> {
    Optional<EmailSubscription> findByEmailAddressIgnoreCase(String emailAddress);

    List<EmailSubscription> findByIsActiveTrueOrderBySubscriptionDateDesc();

    List<EmailSubscription> findAllByOrderBySubscriptionDateDesc();
}

package se.artisan_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.artisan_be.pojo.InquiryRequest;

import java.util.List;

public interface InquiryRequestRepository extends JpaRepository<InquiryRequest, Long> {
    List<InquiryRequest> findAllByOrderByCreatedAtDesc();
}

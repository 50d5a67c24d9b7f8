package se.artisan_be.service;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.artisan_be.dto.request.InquiryCreateRequest;
import se.artisan_be.exception.ResourceNotFoundException;
import se.artisan_be.pojo.InquiryRequest;
import se.artisan_be.repository.InquiryRequestRepository;

import java.util.List;

/**
 * Contact-form leads. A confirmation mail goes out on create; failing to send it does not fail the request.
 */
@Service
@AllArgsConstructor
@Slf4j
public class InquiryService {
    private final InquiryRequestRepository inquiryRequestRepository;
    private final MailService mailService;

    public List<InquiryRequest> findAll() {
        return inquiryRequestRepository.findAllByOrderByCreatedAtDesc();
    }

    public InquiryRequest findById(Long id) {
        return inquiryRequestRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Inquiry", id));
    }

    @Transactional
    public InquiryRequest create(InquiryCreateRequest request) {
        InquiryRequest inquiry = new InquiryRequest();
        apply(inquiry, request);
        InquiryRequest saved = inquiryRequestRepository.save(inquiry);
        log.info("Inquiry {} received from {}", saved.getId(), saved.getEmailAddress());
        mailService.sendInquiryConfirmation(saved.getEmailAddress(), saved.getFullName(), saved.getDesiredCountry());
        return saved;
    }

    @Transactional
    public InquiryRequest update(Long id, InquiryCreateRequest request) {
        InquiryRequest inquiry = findById(id);
        apply(inquiry, request);
        log.info("Inquiry {} updated", id);
        return inquiryRequestRepository.save(inquiry);
    }

    @Transactional
    public void delete(Long id) {
        if (!inquiryRequestRepository.existsById(id)) {
            throw new ResourceNotFoundException("Inquiry", id);
        }
        inquiryRequestRepository.deleteById(id);
        log.info("Inquiry {} deleted", id);
    }

    private static void apply(InquiryRequest inquiry, InquiryCreateRequest request) {
        inquiry.setFullName(request.getFullName());
        inquiry.setEmailAddress(request.getEmailAddress());
        inquiry.setPhoneNumber(request.getPhoneNumber());
        inquiry.setDesiredCountry(request.getDesiredCountry());
        inquiry.setCurrentEducationLevel(request.getCurrentEducationLevel());
        inquiry.setMessage(request.getMessage());
    }
}

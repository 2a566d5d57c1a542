package com.storefront.commerce.application.order;

import com.storefront.commerce.application.order.dto.PlaceOrderCommand;
import com.storefront.commerce.application.order.dto.ShippingAddressCommand;
import com.storefront.commerce.common.exception.InvalidRequestException;
import com.storefront.commerce.domain.order.OrderConstants;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * OrderValidator - 주문 요청 검증 전담
 *
 * 책임:
 * - 배송지 필수 필드(street, city, state, zipCode) 검증
 * - 결제 수단 필수 검증
 * - 배송지/결제 수단 길이 검증 (컬럼 길이 기준)
 * - 주문 메모 길이 검증 (commerce.order.note-max-length, 컬럼 길이 이하만 허용)
 * - 멱등성 키 길이 검증
 *
 * 설계 원칙:
 * - 주문 워크플로우 호출 전에 한 번만 적용 (부수 효과 없음)
 * - 첫 번째 위반 필드를 메시지에 담아 InvalidRequestException 발생
 */
@Component
public class OrderValidator {

    private final int noteMaxLength;

    public OrderValidator(@Value("${commerce.order.note-max-length:" + OrderConstants.DEFAULT_NOTE_MAX_LENGTH + "}")
                          int noteMaxLength) {
        if (noteMaxLength < 0 || noteMaxLength > OrderConstants.NOTE_COLUMN_LENGTH) {
            throw new IllegalArgumentException(String.format(
                    "commerce.order.note-max-length는 0 이상 %d 이하여야 합니다 (설정: %d)",
                    OrderConstants.NOTE_COLUMN_LENGTH, noteMaxLength));
        }
        this.noteMaxLength = noteMaxLength;
    }

    /**
     * 주문 생성 요청 검증
     *
     * @throws InvalidRequestException 필수 값 누락 또는 길이 초과
     */
    public void validatePlaceOrder(PlaceOrderCommand command) {
        if (command == null) {
            throw new InvalidRequestException("요청 본문은 필수입니다");
        }

        ShippingAddressCommand address = command.getShippingAddress();
        if (address == null) {
            throw new InvalidRequestException("shippingAddress는 필수입니다");
        }
        requireText(address.getStreet(), "shippingAddress.street", OrderConstants.ADDRESS_FIELD_MAX_LENGTH);
        requireText(address.getCity(), "shippingAddress.city", OrderConstants.ADDRESS_FIELD_MAX_LENGTH);
        requireText(address.getState(), "shippingAddress.state", OrderConstants.ADDRESS_FIELD_MAX_LENGTH);
        requireText(address.getZipCode(), "shippingAddress.zipCode", OrderConstants.ZIP_CODE_MAX_LENGTH);
        requireMaxLength(address.getCountry(), "shippingAddress.country", OrderConstants.ADDRESS_FIELD_MAX_LENGTH);

        requireText(command.getPaymentMethod(), "paymentMethod", OrderConstants.PAYMENT_METHOD_MAX_LENGTH);

        if (command.getNote() != null && command.getNote().length() > noteMaxLength) {
            throw new InvalidRequestException(
                    String.format("note는 %d자를 초과할 수 없습니다 (입력: %d자)", noteMaxLength, command.getNote().length()));
        }

        if (command.hasCheckoutKey() && command.getCheckoutKey().length() > OrderConstants.MAX_CHECKOUT_KEY_LENGTH) {
            throw new InvalidRequestException(
                    String.format("Idempotency-Key는 %d자를 초과할 수 없습니다", OrderConstants.MAX_CHECKOUT_KEY_LENGTH));
        }
    }

    private void requireText(String value, String fieldName, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException(fieldName + "는 필수입니다");
        }
        requireMaxLength(value, fieldName, maxLength);
    }

    private void requireMaxLength(String value, String fieldName, int maxLength) {
        if (value != null && value.length() > maxLength) {
            throw new InvalidRequestException(
                    String.format("%s는 %d자를 초과할 수 없습니다 (입력: %d자)", fieldName, maxLength, value.length()));
        }
    }
}

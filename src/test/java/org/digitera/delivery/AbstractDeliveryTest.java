package org.digitera.delivery;

import org.digitera.delivery.business.FulfillmentProcessor;
import org.digitera.delivery.domain.PaymentOutcome;
import org.digitera.delivery.domain.PurchaseOrder;
import org.digitera.delivery.event.PaymentConfirmationEvent;
import org.digitera.delivery.gateway.CatalogProduct;
import org.digitera.delivery.gateway.ICatalogGateway;
import org.digitera.delivery.service.IOrderLedgerService;
import org.digitera.delivery.service.IUserAccountService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.mockito.Mockito.when;

/**
 * 集成测试基类
 * 所有测试共用同一个 Spring 上下文（H2 内存库），商品目录由 MockBean 代替
 */
@SpringBootTest
@AutoConfigureMockMvc
public abstract class AbstractDeliveryTest {

    @MockBean
    protected ICatalogGateway catalogGateway;

    @Autowired
    protected IUserAccountService userAccountService;

    @Autowired
    protected IOrderLedgerService orderLedgerService;

    @Autowired
    protected FulfillmentProcessor fulfillmentProcessor;

    protected Long newBuyer() {
        return userAccountService.registerBuyer("buyer-" + UUID.randomUUID() + "@test.local").getId();
    }

    protected static String uniqueId(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    protected static CatalogProduct product(String productId, String price, Integer downloadLimit,
                                            Integer expiryDays) {
        return CatalogProduct.builder()
                .productId(productId)
                .name("Product " + productId)
                .available(true)
                .price(new BigDecimal(price))
                .currency("USD")
                .downloadLimit(downloadLimit)
                .downloadExpiryDays(expiryDays)
                .fileBlobRef("blobs/" + productId + ".zip")
                .build();
    }

    protected void stubCatalog(CatalogProduct... products) {
        for (CatalogProduct product : products) {
            when(catalogGateway.resolveProduct(product.getProductId())).thenReturn(product);
        }
    }

    protected PurchaseOrder createOrder(Long userId, CatalogProduct... products) {
        stubCatalog(products);
        List<String> productIds = Arrays.stream(products)
                .map(CatalogProduct::getProductId)
                .collect(Collectors.toList());
        return orderLedgerService.createOrder(userId, productIds);
    }

    protected static PaymentConfirmationEvent paymentSucceeded(String orderId, String paymentRef) {
        return PaymentConfirmationEvent.builder()
                .orderId(orderId)
                .paymentRef(paymentRef)
                .outcome(PaymentOutcome.SUCCEEDED)
                .sequence(1L)
                .build();
    }

    /**
     * 创建订单并完成支付履约
     */
    protected PurchaseOrder paidOrder(Long userId, CatalogProduct... products) {
        PurchaseOrder order = createOrder(userId, products);
        fulfillmentProcessor.handlePaymentConfirmation(paymentSucceeded(order.getOrderId(), uniqueId("PAY")));
        return orderLedgerService.getOrder(order.getOrderId());
    }
}

package com.example.foodscan.service;

import com.example.foodscan.config.FoodScanProperties;
import com.example.foodscan.config.FoodScanProperties.ClassifierProperties;
import com.example.foodscan.config.FoodScanProperties.OcrProperties;
import com.example.foodscan.config.FoodScanProperties.PriceProperties;
import com.example.foodscan.config.FoodScanProperties.SectionProperties;
import com.example.foodscan.model.Currency;
import com.example.foodscan.model.ProductScan;
import com.example.foodscan.model.RawFragment;
import com.example.foodscan.service.price.PriceParser;
import com.example.foodscan.service.price.PriceQuery;
import com.example.foodscan.service.price.PriceSource;
import com.example.foodscan.service.product.ProductInfoExtractor;
import com.example.foodscan.service.text.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ProductScanServiceTest {

    private static final List<RawFragment> CHIPS = List.of(
            new RawFragment("Crispy Potato Chips", 0.9, 0.5, 0.1),
            new RawFragment("Net Wt 150g", 0.4, 0.5, 0.3),
            new RawFragment("smudge", 0.1, 0.5, 0.6));

    private PriceSource priceSource;
    private ProductScanService service;

    @BeforeEach
    void setUp() {
        priceSource = mock(PriceSource.class);
        service = serviceWithTimeout(Duration.ofSeconds(5));
    }

    @Test
    void shouldConvertSuppliedPriceUsingPrintedWeight() {
        ProductScan scan = service.scan(CHIPS, "₫45,000", null).join();

        assertThat(scan.productInfo().name()).isEqualTo("Crispy Potato Chips");
        assertThat(scan.productInfo().weight().toString()).isEqualTo("150g");
        assertThat(scan.priceInfo().currency()).isEqualTo(Currency.VIETNAMESE_DONG);
        assertThat(scan.priceInfo().convertedAmountText()).isEqualTo("₹148.50");
        assertThat(scan.priceInfo().perKilogramText()).isEqualTo("₫300000/kg (₹990.00/kg)");
        verifyNoInteractions(priceSource);
    }

    @Test
    void shouldUseSuppliedWeightWhenNoneIsPrinted() {
        List<RawFragment> tea = List.of(new RawFragment("Masala Tea", 0.8, 0.5, 0.2));

        ProductScan scan = service.scan(tea, "₹100", 250).join();

        assertThat(scan.productInfo().weight()).isNull();
        assertThat(scan.priceInfo().perKilogramText()).isEqualTo("₹400.00/kg");
    }

    @Test
    void shouldLookUpPriceWhenNoneSupplied() {
        when(priceSource.findPrice(any())).thenReturn(CompletableFuture.completedFuture(Optional.of("₹120")));

        ProductScan scan = service.scan(CHIPS, null, null).join();

        ArgumentCaptor<PriceQuery> query = ArgumentCaptor.forClass(PriceQuery.class);
        verify(priceSource).findPrice(query.capture());
        assertThat(query.getValue().text()).isEqualTo("Crispy Potato Chips 150g");
        assertThat(scan.priceInfo().currency()).isEqualTo(Currency.INDIAN_RUPEE);
        assertThat(scan.priceInfo().perKilogramText()).isEqualTo("₹800.00/kg");
    }

    @Test
    void shouldReturnProductWithoutPriceWhenLookupFindsNothing() {
        when(priceSource.findPrice(any())).thenReturn(CompletableFuture.completedFuture(Optional.empty()));

        ProductScan scan = service.scan(CHIPS, "  ", null).join();

        assertThat(scan.productInfo().name()).isEqualTo("Crispy Potato Chips");
        assertThat(scan.priceInfo()).isNull();
    }

    @Test
    void shouldReturnProductWithoutPriceWhenLookupFails() {
        when(priceSource.findPrice(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("offline")));

        ProductScan scan = service.scan(CHIPS, null, null).join();

        assertThat(scan.productInfo().weight().toGrams()).isEqualTo(150);
        assertThat(scan.priceInfo()).isNull();
    }

    @Test
    void shouldGiveUpOnSlowLookup() {
        when(priceSource.findPrice(any())).thenReturn(new CompletableFuture<>());

        ProductScan scan = serviceWithTimeout(Duration.ofMillis(50)).scan(CHIPS, null, null).join();

        assertThat(scan.priceInfo()).isNull();
    }

    @Test
    void shouldSkipLookupWithoutNameOrWeight() {
        List<RawFragment> priceOnly = List.of(new RawFragment("₹99", 0.9, 0.5, 0.5));

        ProductScan scan = service.scan(priceOnly, null, null).join();

        assertThat(scan.productInfo().name()).isNull();
        assertThat(scan.priceInfo()).isNull();
        verifyNoInteractions(priceSource);
    }

    @Test
    void shouldIgnoreOversizedPrintedWeightWhenConvertingPrice() {
        List<RawFragment> barcode = List.of(
                new RawFragment("Crispy Potato Chips", 0.9, 0.5, 0.1),
                new RawFragment("5000000kg", 0.9, 0.5, 0.3));

        ProductScan withoutWeight = service.scan(barcode, "₫50000", null).join();
        ProductScan withSuppliedWeight = service.scan(barcode, "₹100", 250).join();

        assertThat(withoutWeight.productInfo().weight()).isNull();
        assertThat(withoutWeight.priceInfo().perKilogramText()).isNull();
        assertThat(withSuppliedWeight.priceInfo().perKilogramText()).isEqualTo("₹400.00/kg");
    }

    @Test
    void shouldFailFutureWhenExecutorRejectsWork() {
        FoodScanProperties properties = FoodScanProperties.defaults();
        ProductScanService saturated = new ProductScanService(
                new TextNormalizer(properties.ocr().lineTolerance()),
                new ProductInfoExtractor(),
                new PriceParser(properties.price().dongToRupeeRate()),
                priceSource,
                properties,
                command -> {
                    throw new RejectedExecutionException("queue full");
                });

        CompletableFuture<ProductScan> future = saturated.scan(CHIPS, "₹10", null);

        assertThat(future).isCompletedExceptionally();
        assertThatThrownBy(future::join).hasCauseInstanceOf(RejectedExecutionException.class);
        verifyNoInteractions(priceSource);
    }

    @Test
    void shouldRejectMissingFragments() {
        assertThatThrownBy(() -> service.scan(null, "₹10", null).join())
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    private ProductScanService serviceWithTimeout(Duration timeout) {
        FoodScanProperties properties = new FoodScanProperties(
                new OcrProperties(0.5, 0.3, 0.02),
                new PriceProperties(0.0033, timeout),
                new ClassifierProperties(null, null, null, null, null),
                new SectionProperties(null, null, null));
        return new ProductScanService(
                new TextNormalizer(properties.ocr().lineTolerance()),
                new ProductInfoExtractor(),
                new PriceParser(properties.price().dongToRupeeRate()),
                priceSource,
                properties,
                Runnable::run);
    }
}

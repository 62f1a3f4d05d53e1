module finmoney.main {
    requires transitive info.picocli;
    requires transitive jakarta.json;
    requires org.slf4j;
    exports com.amannmalik.finmoney.api.currency;
    exports com.amannmalik.finmoney.api.money;
    exports com.amannmalik.finmoney.api.rounding;
    exports com.amannmalik.finmoney.api.shared;
    exports com.amannmalik.finmoney.cli;
    exports com.amannmalik.finmoney.codec;
    exports com.amannmalik.finmoney.util;
    opens com.amannmalik.finmoney.cli to info.picocli;
}

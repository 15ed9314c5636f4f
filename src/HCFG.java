import driver.HCFGDriver;

public class HCFG {
    /*
     * move the duty of the tool to driver,
     * for we can't use package here
     */
    public static void main(String[] args) {
        HCFGDriver driver = HCFGDriver.getInstance();
        driver.parseArgs(args);
        driver.run();
    }
}

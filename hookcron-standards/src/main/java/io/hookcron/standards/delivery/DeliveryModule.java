package io.hookcron.standards.delivery;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import io.hookcron.spi.DeliverySender;

public class DeliveryModule
    implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(DeliverySender.class).to(HttpDeliverySender.class).in(Scopes.SINGLETON);
    }
}
